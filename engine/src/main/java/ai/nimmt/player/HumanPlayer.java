package ai.nimmt.player;

import ai.nimmt.game.Card;
import ai.nimmt.session.GameSession;
import java.util.Scanner;
import org.springframework.stereotype.Component;

/**
 * Human player that reads commands from stdin (CLI).
 */
@Component
public class HumanPlayer implements Player {
    private final Scanner scanner = new Scanner(System.in);

    @Override
    public String nextCommand(GameSession session, String feedback) {
        if (!feedback.isBlank()) {
            System.out.println(feedback);
        }
        System.out.print("Enter command (CARD [ROW] | quit): ");
        return readLine();
    }

    @Override
    public String chooseRow(GameSession session, Card card) {
        System.out.print("Card " + card + " fits no row. Row to take (1-4): ");
        return readLine();
    }

    private String readLine() {
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine();
    }
}
