package com.example.media_acquisition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaAcquisitionApplication {

	public static void main(String[] args) {
		SpringApplication.run(MediaAcquisitionApplication.class, args);
	}

}
