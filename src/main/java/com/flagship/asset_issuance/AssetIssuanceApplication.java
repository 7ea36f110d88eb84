package com.flagship.asset_issuance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetIssuanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetIssuanceApplication.class, args);
    }
}
