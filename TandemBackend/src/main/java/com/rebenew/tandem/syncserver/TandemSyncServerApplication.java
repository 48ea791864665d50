package com.rebenew.tandem.syncserver;

import com.rebenew.tandem.syncserver.config.SyncProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SyncProperties.class)
public class TandemSyncServerApplication {
	public static void main(String[] args) {
		SpringApplication.run(TandemSyncServerApplication.class, args);
	}
}
