package p8lua.ast;

import java.util.ArrayList;
import java.util.List;

final class ListSupport {
    private ListSupport() {}

    static List<Lexeme> commas(int items) {
        List<Lexeme> out = new ArrayList<>();
        for (int i = 1; i < items; i++) out.add(Lexeme.symbol(","));
        return out;
    }
}
