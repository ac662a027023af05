package com.bbthechange.teaminvite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TeamInviteApplication {

	public static void main(String[] args) {
		SpringApplication.run(TeamInviteApplication.class, args);
	}
}
