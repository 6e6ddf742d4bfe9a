package ai.nimmt.session;

import static ai.nimmt.unit.helpers.BoardBuilder.numbers;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.nimmt.game.AmbiguousActionException;
import ai.nimmt.game.GameOutcome;
import ai.nimmt.game.IllegalMoveException;
import ai.nimmt.game.ParticipantId;
import ai.nimmt.game.RoundEvent;
import ai.nimmt.game.RoundEventType;
import ai.nimmt.game.Submission;
import ai.nimmt.gateway.AiAlgorithm;
import ai.nimmt.gateway.AiMoveGateway;
import ai.nimmt.gateway.AiMoveResponse;
import ai.nimmt.unit.helpers.PreparedDeck;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class MatchRuntimeTest {

    private static final List<Integer> HUMAN = List.of(12, 15, 23, 34, 48, 57, 61, 72, 89, 2);
    private static final List<Integer> AI = List.of(7, 16, 25, 39, 51, 64, 77, 82, 95, 103);
    private static final List<Integer> STARTERS = List.of(10, 20, 30, 40);

    private static GameSession session() {
        return GameSession.standard(PreparedDeck.dealing(HUMAN, AI, STARTERS));
    }

    private static MatchRuntime started(AiMoveGateway gateway, long timeoutMillis) throws Exception {
        MatchRuntime runtime = new MatchRuntime(session(), gateway, AiAlgorithm.EXPECTIMINIMAX, timeoutMillis);
        runtime.start().get(5, TimeUnit.SECONDS);
        return runtime;
    }

    private static AiMoveGateway plays(int card) {
        return request -> AiMoveResponse.of(card);
    }

    @Test
    void roundResolvesWithTheGatewayCard() throws Exception {
        try (MatchRuntime runtime = started(plays(16), 5_000)) {
            List<RoundEvent> events =
                    runtime.playRound(Submission.of(ParticipantId.HUMAN, 12)).get(5, TimeUnit.SECONDS);

            assertTrue(events.stream().anyMatch(e -> e.type() == RoundEventType.ROUND_COMPLETE));
            assertEquals(List.of(10, 12, 16), numbers(runtime.session().board().rowCards(0)));
            assertEquals(2, runtime.session().roundNumber());
        }
    }

    @Test
    void slowGatewayIsReplacedByLowestCard() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AiMoveGateway stuck = request -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AiMoveResponse.of(103);
        };
        try (MatchRuntime runtime = started(stuck, 100)) {
            runtime.playRound(Submission.of(ParticipantId.HUMAN, 12)).get(5, TimeUnit.SECONDS);

            // 7 fits no row, so the AI takes the cheapest row (row 1, lowest index among ties).
            GameSession session = runtime.session();
            assertEquals(3, session.score(ParticipantId.AI));
            assertEquals(List.of(7, 12), numbers(session.board().rowCards(0)));
            assertTrue(session.hand(ParticipantId.AI).find(103).isPresent());
        } finally {
            release.countDown();
        }
    }

    @Test
    void cardTheAiDoesNotHoldIsReplacedByLowestCard() throws Exception {
        // 12 is in the human's hand, not the AI's.
        try (MatchRuntime runtime = started(plays(12), 5_000)) {
            runtime.playRound(Submission.of(ParticipantId.HUMAN, 15)).get(5, TimeUnit.SECONDS);

            GameSession session = runtime.session();
            assertEquals(2, session.roundNumber());
            assertEquals(3, session.score(ParticipantId.AI));
            assertEquals(List.of(7, 15), numbers(session.board().rowCards(0)));

            runtime.playRound(Submission.of(ParticipantId.HUMAN, 23)).get(5, TimeUnit.SECONDS);

            assertEquals(3, session.roundNumber());
            assertEquals(List.of(7, 15, 16), numbers(session.board().rowCards(0)));
            assertEquals(List.of(20, 23), numbers(session.board().rowCards(1)));
        }
    }

    @Test
    void cardNumberOffTheDeckIsReplacedByLowestCard() throws Exception {
        try (MatchRuntime runtime = started(plays(105), 5_000)) {
            runtime.playRound(Submission.of(ParticipantId.HUMAN, 15)).get(5, TimeUnit.SECONDS);

            assertEquals(2, runtime.session().roundNumber());
            assertTrue(runtime.session().hand(ParticipantId.AI).find(7).isEmpty());
        }
    }

    @Test
    void answerArrivingAfterAbandonIsDropped() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AiMoveGateway late = request -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return AiMoveResponse.of(16);
        };
        try (MatchRuntime runtime = started(late, 5_000)) {
            CompletableFuture<List<RoundEvent>> aiMove = runtime.requestAiMove();
            runtime.abandon().get(5, TimeUnit.SECONDS);
            release.countDown();

            assertTrue(aiMove.get(5, TimeUnit.SECONDS).isEmpty());
            assertEquals(GameOutcome.ABANDONED, runtime.session().outcome().orElseThrow());
            assertFalse(runtime.session().hasSubmitted(ParticipantId.AI));
            assertEquals(10, runtime.session().hand(ParticipantId.AI).size());
        } finally {
            release.countDown();
        }
    }

    @Test
    void rejectedHumanMoveKeepsTheAiCard() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AiMoveGateway counting = request -> {
            calls.incrementAndGet();
            return AiMoveResponse.of(16);
        };
        try (MatchRuntime runtime = started(counting, 5_000)) {
            ExecutionException rejected = assertThrows(ExecutionException.class,
                    () -> runtime.playRound(Submission.of(ParticipantId.HUMAN, 16)).get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalMoveException.class, rejected.getCause());
            assertTrue(runtime.session().hasSubmitted(ParticipantId.AI));

            runtime.playRound(Submission.of(ParticipantId.HUMAN, 12)).get(5, TimeUnit.SECONDS);

            assertEquals(1, calls.get());
            assertEquals(2, runtime.session().roundNumber());
        }
    }

    @Test
    void blockedHumanCardIsFinishedWithRowChoice() throws Exception {
        try (MatchRuntime runtime = started(plays(16), 5_000)) {
            ExecutionException blocked = assertThrows(ExecutionException.class,
                    () -> runtime.playRound(Submission.of(ParticipantId.HUMAN, 2)).get(5, TimeUnit.SECONDS));
            assertInstanceOf(AmbiguousActionException.class, blocked.getCause());

            List<RoundEvent> events = runtime.chooseRow(ParticipantId.HUMAN, 1).get(5, TimeUnit.SECONDS);

            assertEquals(RoundEventType.ROW_TAKEN, events.get(0).type());
            GameSession session = runtime.session();
            assertEquals(3, session.score(ParticipantId.HUMAN));
            assertEquals(List.of(10, 16), numbers(session.board().rowCards(0)));
            assertEquals(List.of(2), numbers(session.board().rowCards(1)));
        }
    }

    @Test
    void onlyHumanSubmissionsAreAccepted() throws Exception {
        try (MatchRuntime runtime = started(plays(16), 5_000)) {
            assertThrows(IllegalArgumentException.class,
                    () -> runtime.submitHuman(Submission.of(ParticipantId.AI, 16)));
        }
    }
}
