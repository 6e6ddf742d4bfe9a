package ai.nimmt;

import ai.nimmt.config.GatewayProperties;
import ai.nimmt.config.RulesProperties;
import ai.nimmt.game.AmbiguousActionException;
import ai.nimmt.game.BoardFormatter;
import ai.nimmt.game.Card;
import ai.nimmt.game.GameOutcome;
import ai.nimmt.game.IllegalMoveException;
import ai.nimmt.game.ParticipantId;
import ai.nimmt.game.RandomSource;
import ai.nimmt.game.RoundEvent;
import ai.nimmt.game.ScoringEngine;
import ai.nimmt.game.Submission;
import ai.nimmt.game.TurnResolver;
import ai.nimmt.gateway.AiAlgorithm;
import ai.nimmt.gateway.AiMoveGateway;
import ai.nimmt.player.Player;
import ai.nimmt.session.DeckSource;
import ai.nimmt.session.GamePhase;
import ai.nimmt.session.GameSession;
import ai.nimmt.session.MatchRuntime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final Player player;
    private final AiMoveGateway gateway;
    private final RulesProperties rules;
    private final GatewayProperties gatewayProperties;

    public Game(Player player, AiMoveGateway gateway, RulesProperties rules, GatewayProperties gatewayProperties) {
        this.player = player;
        this.gateway = gateway;
        this.rules = rules;
        this.gatewayProperties = gatewayProperties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        play();
    }

    /**
     * Core game loop used by both the CLI runner and automated tests.
     *
     * <p>Each pass renders the table, asks the player for a card, and plays the round against
     * the AI through a {@link MatchRuntime}. Illegal commands are fed back to the player on the
     * next prompt. A card that fits no row triggers a row prompt before the round can finish.
     * Setting {@code -Dgame.seed=N} deals a reproducible game.
     *
     * @return outcome, final scores, rounds resolved and how long the game took.
     */
    public GameResult play() {
        Long seed = Long.getLong("game.seed");
        RandomSource random = seed != null ? RandomSource.seeded(seed) : RandomSource.threadLocal();
        return play(DeckSource.shuffled(random));
    }

    /**
     * Plays one game dealt from the given source.
     */
    GameResult play(DeckSource deckSource) {
        ScoringEngine scoring = new ScoringEngine(rules.getScoreLimit());
        GameSession session = new GameSession(
                rules.getHandSize(), scoring, TurnResolver.withAiFallback(scoring), deckSource);
        AiAlgorithm algorithm = AiAlgorithm.fromName(gatewayProperties.getAlgorithm());
        long startNanos = System.nanoTime();

        try (MatchRuntime runtime =
                     new MatchRuntime(session, gateway, algorithm, gatewayProperties.getMoveTimeoutMillis())) {
            report(await(runtime.start()));
            String feedback = "";
            while (session.phase() != GamePhase.GAME_OVER) {
                printTable(session);
                String input = player.nextCommand(session, feedback);
                feedback = "";
                if (input == null || "quit".equalsIgnoreCase(input.trim())) {
                    report(await(runtime.abandon()));
                    break;
                }

                Submission move;
                try {
                    move = parseCommand(input);
                } catch (IllegalArgumentException e) {
                    feedback = "Could not read \"" + input.trim() + "\": " + e.getMessage();
                    continue;
                }

                try {
                    report(await(runtime.playRound(move)));
                } catch (IllegalMoveException e) {
                    feedback = "Illegal move: " + e.getMessage();
                } catch (AmbiguousActionException e) {
                    if (!resolveRowChoice(runtime, session, e.getCard())) {
                        report(await(runtime.abandon()));
                        break;
                    }
                }
            }
        }

        long durationNanos = System.nanoTime() - startNanos;
        GameOutcome outcome = session.outcome().orElse(GameOutcome.ABANDONED);
        return new GameResult(
                outcome,
                session.score(ParticipantId.HUMAN),
                session.score(ParticipantId.AI),
                session.roundsCompleted(),
                durationNanos);
    }

    /**
     * Parses {@code "CARD"} or {@code "CARD ROW"}; rows are numbered 1–4 for players.
     */
    static Submission parseCommand(String input) {
        String[] parts = input.trim().split("\\s+");
        if (parts.length == 0 || parts.length > 2 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("expected CARD or CARD ROW");
        }
        Card card = Card.of(Integer.parseInt(parts[0]));
        if (parts.length == 1) {
            return new Submission(ParticipantId.HUMAN, card, null);
        }
        return new Submission(ParticipantId.HUMAN, card, Integer.parseInt(parts[1]) - 1);
    }

    private boolean resolveRowChoice(MatchRuntime runtime, GameSession session, Card card) {
        while (true) {
            String input = player.chooseRow(session, card);
            if (input == null || "quit".equalsIgnoreCase(input.trim())) {
                return false;
            }
            try {
                int row = Integer.parseInt(input.trim()) - 1;
                report(await(runtime.chooseRow(ParticipantId.HUMAN, row)));
                return true;
            } catch (NumberFormatException e) {
                log.info("\"{}\" is not a row number", input.trim());
            } catch (IllegalMoveException e) {
                log.info("Illegal row choice: {}", e.getMessage());
            }
        }
    }

    private void printTable(GameSession session) {
        BoardFormatter formatter = new BoardFormatter(session.board());
        log.info("\nRound {} (deal {})\n{}", session.roundNumber(), session.dealNumber(),
                formatter.formatTable(
                        session.hand(ParticipantId.HUMAN),
                        session.hand(ParticipantId.AI).size(),
                        session.score(ParticipantId.HUMAN),
                        session.score(ParticipantId.AI)));
    }

    private void report(List<RoundEvent> events) {
        for (RoundEvent event : events) {
            switch (event.type()) {
                case PLACED -> log.info("{} lays {} on row {}", event.get("participant"), event.get("card"),
                        event.<Integer>get("row") + 1);
                case ROW_TAKEN -> log.info("{} plays {} and takes row {} {} for {} bull heads",
                        event.get("participant"), event.get("card"), event.<Integer>get("row") + 1,
                        event.get("taken"), event.get("bullHeads"));
                case GAME_OVER -> log.info("Game over: {} (you {}, ai {})", event.get("outcome"),
                        event.get("humanScore"), event.get("aiScore"));
                default -> {
                    if (log.isDebugEnabled()) {
                        log.debug("{}", event);
                    }
                }
            }
        }
    }

    /**
     * Waits for a runtime step and rethrows rule errors as themselves.
     */
    private static List<RoundEvent> await(CompletableFuture<List<RoundEvent>> step) {
        try {
            return step.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public static final class GameResult {
        private final GameOutcome outcome;
        private final int humanScore;
        private final int aiScore;
        private final int rounds;
        private final long durationNanos;

        public GameResult(GameOutcome outcome, int humanScore, int aiScore, int rounds, long durationNanos) {
            this.outcome = outcome;
            this.humanScore = humanScore;
            this.aiScore = aiScore;
            this.rounds = rounds;
            this.durationNanos = durationNanos;
        }

        public GameOutcome getOutcome() {
            return outcome;
        }

        public int getHumanScore() {
            return humanScore;
        }

        public int getAiScore() {
            return aiScore;
        }

        public int getRounds() {
            return rounds;
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }
}
