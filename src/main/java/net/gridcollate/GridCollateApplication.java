/**
 * Main application class for the grid collator
 *
 * Features:
 * - Runs without a web server; a single collation pass per invocation
 * - Exits with the run's exit code so scripts can detect aborted runs
 */

package net.gridcollate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridCollateApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GridCollateApplication.class, args)));
    }
}
