package com.jefflower.translator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TranslatorWorkerApplication {

	public static void main(String[] args) {
		SpringApplication.run(TranslatorWorkerApplication.class, args);
	}

}
