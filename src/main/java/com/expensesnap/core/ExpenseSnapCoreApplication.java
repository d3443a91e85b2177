package com.expensesnap.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.expensesnap.core")
@EnableJpaRepositories(basePackages = "com.expensesnap.core.infrastructure.jpa")
@EntityScan(basePackages = "com.expensesnap.core.infrastructure.jpa")
public class ExpenseSnapCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(ExpenseSnapCoreApplication.class, args);
	}
}
