package flowwatch.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Punto de entrada del servicio de aforos.
 * <p>
 * Responsabilidades:
 * 1. Arrancar el contexto de Spring Boot (Web, cliente USGS, planificador).
 * 2. Exponer el dataset procesado y el control del pipeline por REST.
 */
@EnableScheduling
@SpringBootApplication(scanBasePackages = "flowwatch.compute")
public class ComputeEngineApplication {

    public static void main(String[] args) {
        // El puerto se puede configurar vía args: --server.port=9090
        SpringApplication.run(ComputeEngineApplication.class, args);
    }
}
