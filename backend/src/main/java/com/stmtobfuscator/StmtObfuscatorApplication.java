package com.stmtobfuscator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bank statement PII obfuscation service.
 */
@SpringBootApplication
public class StmtObfuscatorApplication {

	public static void main(String[] args) {
		SpringApplication.run(StmtObfuscatorApplication.class, args);
	}

}
