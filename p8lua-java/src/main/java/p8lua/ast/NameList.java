package p8lua.ast;

import java.util.List;

public record NameList(List<Lexeme> names, List<Lexeme> commas) implements Node {

    public NameList {
        names = List.copyOf(names);
        commas = List.copyOf(commas);
    }

    public static NameList of(List<Lexeme> names) {
        return new NameList(names, ListSupport.commas(names.size()));
    }
}
