package games.dog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DogApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(DogApplication.class);

    private final Match match;

    public DogApplication(Match match) {
        this.match = match;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DogApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        Match.MatchResult result = match.play();
        log.info("{}", result);
    }
}
