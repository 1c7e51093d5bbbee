package com.example.securebudget.config;

import com.example.securebudget.console.BudgetConsole;
import com.example.securebudget.console.ConsoleErrorHandler;
import com.example.securebudget.service.BudgetService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;

/**
 * Starts the interactive menu on stdin/stdout once the context is up.
 *
 * Properties:
 * - budget.console.enabled: set to false to start the context without the menu (tests).
 */
@Configuration
@ConditionalOnProperty(name = "budget.console.enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleConfig {

    @Bean
    public CommandLineRunner budgetConsoleRunner(BudgetService budgetService, ConsoleErrorHandler errorHandler) {
        return args -> {
            Charset charset = Charset.defaultCharset();
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, charset));
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, charset), true);
            new BudgetConsole(budgetService, errorHandler, in, out).run();
        };
    }
}
