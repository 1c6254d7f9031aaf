package com.yunhwan.rabbit.retry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RabbitRetryApplication {

	public static void main(String[] args) {
		SpringApplication.run(RabbitRetryApplication.class, args);
	}

}
