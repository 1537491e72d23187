package fun.fengwk.lds.cli.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.lds")
public class CliScraperApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(CliScraperApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.run(args);
    }

}
