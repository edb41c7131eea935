package com.officehub.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BackendApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC for consistent logs and booking math
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(BackendApplication.class, args);
	}

}

/*
Must stay in the root package: component scanning starts here, so moving it into a
sub-package would hide every module outside that sub-package.
 */
