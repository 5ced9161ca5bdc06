package by.losik.quickadd;

import by.losik.quickadd.composition.root.CompositionRoot;
import by.losik.quickadd.config.ParserConfig;
import by.losik.quickadd.dto.ParsedTask;
import by.losik.quickadd.service.QuickAddService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Scanner;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.setProperty("file.encoding", "UTF-8");

        try {
            Injector injector = Guice.createInjector(new CompositionRoot());
            QuickAddService quickAddService = injector.getInstance(QuickAddService.class);
            ObjectMapper objectMapper = injector.getInstance(ObjectMapper.class);
            ParserConfig config = injector.getInstance(ParserConfig.class);
            log.info("Quick-add parser started, timezone {}", config.getZoneId());

            runConsoleApp(quickAddService, objectMapper, config);

        } catch (Exception e) {
            System.err.println("Failed to start: " + e.getMessage());
            e.printStackTrace();
        }
    }

    private static void runConsoleApp(QuickAddService quickAddService, ObjectMapper objectMapper,
                                      ParserConfig config) {
        Scanner scanner = new Scanner(System.in);
        System.out.println("=== Quick add ===");
        System.out.println("Type a task, e.g. \"Call mom tomorrow at 5pm #family\". :q or exit to quit.");

        while (true) {
            System.out.print("\n> ");
            if (!scanner.hasNextLine()) {
                System.out.println("\nEnd of input.");
                break;
            }

            String line = scanner.nextLine();
            if (line.isBlank()) {
                continue;
            }
            if (line.trim().equals(":q") || line.trim().equalsIgnoreCase("exit")) {
                System.out.println("Bye.");
                break;
            }

            try {
                printResult(line, quickAddService, objectMapper, config);
            } catch (Exception e) {
                System.err.println("Error: " + e.getMessage());
            }
        }
        scanner.close();
    }

    private static void printResult(String line, QuickAddService quickAddService, ObjectMapper objectMapper,
                                    ParserConfig config) throws JsonProcessingException {
        boolean parseable = quickAddService.looksParseable(line);
        ParsedTask parsed = quickAddService.parse(line);
        List<String> badges = quickAddService.formatForDisplay(parsed);

        System.out.println("Recognised: " + (parseable ? "yes" : "no"));
        if (!badges.isEmpty()) {
            System.out.println(String.join("  ", badges));
        }
        System.out.println("Title: " + parsed.text());
        if (config.isOutputJson()) {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(parsed));
        }
    }
}
