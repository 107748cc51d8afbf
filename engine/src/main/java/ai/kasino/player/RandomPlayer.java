package ai.kasino.player;

import ai.kasino.config.KasinoProperties;
import ai.kasino.game.GameState;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Baseline player that picks uniformly among the legal commands.
 * <p>
 * With a seed the sequence of choices is reproducible, which the self-play tests rely on.
 */
@Component
@Profile("ai-random")
public class RandomPlayer implements Player {
    private static final Logger log = LoggerFactory.getLogger(RandomPlayer.class);

    private final Random random;

    @Autowired
    public RandomPlayer(KasinoProperties properties) {
        this(properties.getSeed() == null ? new Random() : new Random(properties.getSeed()));
    }

    public RandomPlayer(Random random) {
        this.random = random;
    }

    @Override
    public String nextCommand(GameState state, List<String> legalMoves, String feedback) {
        if (legalMoves == null || legalMoves.isEmpty()) {
            return null;
        }
        if (feedback != null && !feedback.isEmpty() && log.isDebugEnabled()) {
            log.debug("Previous command refused: {}", feedback);
        }
        return legalMoves.get(random.nextInt(legalMoves.size()));
    }
}
