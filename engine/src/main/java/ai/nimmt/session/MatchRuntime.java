package ai.nimmt.session;

import ai.nimmt.game.Card;
import ai.nimmt.game.ParticipantId;
import ai.nimmt.game.RoundEvent;
import ai.nimmt.game.Submission;
import ai.nimmt.gateway.AiAlgorithm;
import ai.nimmt.gateway.AiMoveGateway;
import ai.nimmt.gateway.AiMoveRequest;
import ai.nimmt.gateway.AiMoveResponse;
import ai.nimmt.gateway.ResilientAiMoveGateway;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a {@link GameSession} from two independent sources: the human's moves and the AI
 * move gateway.
 * <p>
 * Every session mutation runs on a single mailbox thread, so the session sees one call at a
 * time and a round resolves in one step. Gateway calls run on a separate pool and are bounded
 * by a timeout; a call that times out, fails, or names a card the AI does not hold is replaced
 * by the lowest card in the AI's hand.
 * <p>
 * An AI answer is delivered only if the session is still waiting on the round it was requested
 * for. Answers arriving after game over, or for an earlier round, are dropped.
 */
public final class MatchRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MatchRuntime.class);
    private static final AtomicInteger RUNTIME_IDS = new AtomicInteger();

    private final GameSession session;
    private final AiMoveGateway gateway;
    private final AiAlgorithm algorithm;
    private final long aiTimeoutMillis;
    private final ExecutorService mailbox;
    private final ExecutorService gatewayPool;

    /** Round whose AI request has been issued; touched only on the mailbox thread. */
    private int aiRequestedRound;

    /**
     * @param session the session to drive; nothing else should mutate it
     * @param gateway source of AI moves
     * @param algorithm algorithm named in each request
     * @param aiTimeoutMillis upper bound for one AI move, retries included
     */
    public MatchRuntime(GameSession session, AiMoveGateway gateway, AiAlgorithm algorithm, long aiTimeoutMillis) {
        this.session = Objects.requireNonNull(session, "session");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        if (aiTimeoutMillis <= 0) {
            throw new IllegalArgumentException("aiTimeoutMillis must be positive");
        }
        this.aiTimeoutMillis = aiTimeoutMillis;
        int id = RUNTIME_IDS.incrementAndGet();
        this.mailbox = Executors.newSingleThreadExecutor(named("nimmt-session-" + id));
        this.gatewayPool = Executors.newCachedThreadPool(named("nimmt-gateway-" + id));
    }

    public GameSession session() {
        return session;
    }

    public CompletableFuture<List<RoundEvent>> start() {
        return CompletableFuture.supplyAsync(session::start, mailbox);
    }

    /**
     * Submits the human's card and, unless already done for this round, asks the gateway for
     * the AI's card at the same time.
     *
     * @return the round's events once both cards are resolved; completes exceptionally with
     *         {@link ai.nimmt.game.IllegalMoveException} or {@link ai.nimmt.game.AmbiguousActionException}
     */
    public CompletableFuture<List<RoundEvent>> playRound(Submission humanMove) {
        CompletableFuture<List<RoundEvent>> ai = requestAiMove();
        CompletableFuture<List<RoundEvent>> human = submitHuman(humanMove);
        return human.thenCombine(ai, MatchRuntime::concat);
    }

    public CompletableFuture<List<RoundEvent>> submitHuman(Submission humanMove) {
        if (humanMove.participant() != ParticipantId.HUMAN) {
            throw new IllegalArgumentException("Expected a HUMAN submission, got " + humanMove.participant());
        }
        return CompletableFuture.supplyAsync(() -> session.submit(humanMove), mailbox);
    }

    /**
     * Asks the gateway for the AI's card for the current round. Does nothing if the AI has
     * already been asked for this round or the session is not waiting for moves.
     *
     * @return the round's events if the AI's card completed the round, otherwise an empty list
     */
    public CompletableFuture<List<RoundEvent>> requestAiMove() {
        return CompletableFuture.supplyAsync(this::prepareAiRequest, mailbox)
                .thenCompose(request -> request
                        .map(this::callGateway)
                        .orElseGet(() -> CompletableFuture.completedFuture(List.of())));
    }

    public CompletableFuture<List<RoundEvent>> chooseRow(ParticipantId participant, int rowIndex) {
        return CompletableFuture.supplyAsync(() -> session.chooseRow(participant, rowIndex), mailbox);
    }

    public CompletableFuture<List<RoundEvent>> abandon() {
        return CompletableFuture.supplyAsync(session::abandon, mailbox);
    }

    private Optional<AiMoveRequest> prepareAiRequest() {
        if (session.phase() != GamePhase.AWAITING_SUBMISSIONS
                || session.hasSubmitted(ParticipantId.AI)
                || aiRequestedRound == session.roundNumber()) {
            return Optional.empty();
        }
        int round = session.roundNumber();
        aiRequestedRound = round;
        return Optional.of(AiMoveRequest.of(
                session.board(),
                session.hand(ParticipantId.AI),
                session.hand(ParticipantId.HUMAN).size(),
                session.score(ParticipantId.HUMAN),
                session.score(ParticipantId.AI),
                algorithm,
                round));
    }

    private CompletableFuture<List<RoundEvent>> callGateway(AiMoveRequest request) {
        return CompletableFuture.supplyAsync(() -> {
                    AiMoveResponse response = gateway.chooseMove(request);
                    ResilientAiMoveGateway.validate(request, response);
                    return response;
                }, gatewayPool)
                .orTimeout(aiTimeoutMillis, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    log.warn("AI move for round {} failed: {}", request.getRound(), ex.toString());
                    return ResilientAiMoveGateway.fallback(request);
                })
                .thenApplyAsync(response -> deliverAiMove(request.getRound(), response), mailbox);
    }

    private List<RoundEvent> deliverAiMove(int round, AiMoveResponse response) {
        if (session.phase() == GamePhase.GAME_OVER) {
            log.info("Discarding AI move {} for round {}: game is over", response, round);
            return List.of();
        }
        if (session.roundNumber() != round || session.hasSubmitted(ParticipantId.AI)) {
            log.info("Discarding stale AI move {} for round {} (session at round {})", response, round,
                    session.roundNumber());
            return List.of();
        }
        Card card = Card.of(response.getChosenCardNumber());
        return session.submit(new Submission(ParticipantId.AI, card, response.getRowChoice()));
    }

    private static List<RoundEvent> concat(List<RoundEvent> first, List<RoundEvent> second) {
        List<RoundEvent> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        gatewayPool.shutdownNow();
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(3, TimeUnit.SECONDS)) {
                mailbox.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            mailbox.shutdownNow();
        }
    }
}
