package co.fanki.flowengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Flow Engine Application.
 *
 * <p>Serves the questionnaire flow engine over HTTP: structural
 * validation for the publish workflow, routing and answer piping for the
 * respondent runtime, branch highlighting and auto-arrange for the
 * editor.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class FlowEngineApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(FlowEngineApplication.class, args);
    }

}
