package com.sommerph.didvault.model.vault;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedCredential {

    private String vcId;

    // Base64 AES-GCM output, tag appended
    private String cipherText;
    private String salt;
    private String iv;

    private String storedAt;

}
