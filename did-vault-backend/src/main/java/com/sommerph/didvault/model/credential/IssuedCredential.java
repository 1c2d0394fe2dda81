package com.sommerph.didvault.model.credential;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssuedCredential {

    private VerifiableCredential credential;

    private String jwt;

    private String id;

    private String expiresAt;

}
