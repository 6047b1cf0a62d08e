package com.p0ntus.now_playing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NowPlayingAggregatorApplication {

	public static void main(String[] args) {
		SpringApplication.run(NowPlayingAggregatorApplication.class, args);
	}
}
