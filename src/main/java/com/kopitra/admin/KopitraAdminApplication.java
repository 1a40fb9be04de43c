package com.kopitra.admin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class KopitraAdminApplication {

	public static void main(String[] args) {
		SpringApplication.run(KopitraAdminApplication.class, args);
	}

}
