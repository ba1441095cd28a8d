package com.gt.dailyprep;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.ApplicationPidFileWriter;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan("com.gt.dailyprep")
public class DailyPrepApplication {

	public static void main(String[] args) {
		SpringApplication springApplication = new SpringApplication(DailyPrepApplication.class);
		springApplication.addListeners(new ApplicationPidFileWriter());
		springApplication.run(args);
	}

}
