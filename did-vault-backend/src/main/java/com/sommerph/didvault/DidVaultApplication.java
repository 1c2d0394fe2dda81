package com.sommerph.didvault;

import com.sommerph.didvault.config.VaultProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(VaultProperties.class)
public class DidVaultApplication {

	public static void main(String[] args) {
		SpringApplication.run(DidVaultApplication.class, args);
	}

}
