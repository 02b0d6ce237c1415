package io.taro.assetstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AssetStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssetStoreApplication.class, args);
    }
}
