package com.claimsagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Claims Agent - FNOL field extraction and claim routing.
 */
@SpringBootApplication
public class ClaimsAgentApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(ClaimsAgentApplication.class, args)));
	}

}
