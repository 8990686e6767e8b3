package org.analisis_llamadas;

import org.analisis_llamadas.runner.AnalisisCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Clase principal de la aplicación Spring Boot
 * Sistema de Análisis de Categorías de Llamadas
 *
 * Con --files o --pattern se ejecuta como línea de comandos y termina con
 * el código de salida del análisis; sin ellos levanta el servidor web del dashboard.
 */
@SpringBootApplication
public class App {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(App.class);

        if (AnalisisCommandLineRunner.esInvocacionCli(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            ConfigurableApplicationContext context = application.run(args);
            System.exit(SpringApplication.exit(context));
        }

        application.run(args);
    }
}
