package games.dog.unit.config;

import static org.junit.jupiter.api.Assertions.*;

import games.dog.Match;
import games.dog.config.DogConfiguration;
import games.dog.config.DogProperties;
import games.dog.game.DogGame;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class DogConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(DogConfiguration.class);

    @Test
    void defaultsPlayWithCardExchange() {
        contextRunner.run(context -> {
            DogProperties properties = context.getBean(DogProperties.class);
            assertNull(properties.getSeed());
            assertTrue(properties.isCardExchange());
            assertEquals(10_000, properties.getMaxActionsPerMatch());
            assertNotNull(context.getBean(Match.class));
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void propertiesShapeTheGames() {
        contextRunner
                .withPropertyValues("dog.seed=42", "dog.card-exchange=false", "dog.max-actions-per-match=50")
                .run(context -> {
                    Supplier<DogGame> games = context.getBean("dogGames", Supplier.class);
                    assertTrue(games.get().getState().isCardExchanged());
                    assertTrue(context.getBean(Match.class).play().getActions() <= 50);
                });
    }

    @Test
    void rejectsNonPositiveActionCap() {
        contextRunner
                .withPropertyValues("dog.max-actions-per-match=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }
}
