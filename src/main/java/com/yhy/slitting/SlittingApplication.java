package com.yhy.slitting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlittingApplication {

	public static void main(String[] args) {
		SpringApplication.run(SlittingApplication.class, args);
	}

}
