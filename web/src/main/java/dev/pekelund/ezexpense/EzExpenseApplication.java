package dev.pekelund.ezexpense;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EzExpenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(EzExpenseApplication.class, args);
    }
}
