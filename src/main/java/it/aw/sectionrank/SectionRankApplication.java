package it.aw.sectionrank;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto di ingresso: elabora una collezione e termina con l'exit code del runner.
 */
@SpringBootApplication
public class SectionRankApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SectionRankApplication.class, args)));
    }
}
