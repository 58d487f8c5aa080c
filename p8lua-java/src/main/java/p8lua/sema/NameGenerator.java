package p8lua.sema;

import java.util.function.Predicate;

/** Short identifiers in a fixed order: {@code a} to {@code z}, then {@code aa}, {@code ab}, and so on. */
public final class NameGenerator {
    private NameGenerator() {}

    /** The {@code index}-th name, counting from 0. */
    public static String name(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            sb.append((char) ('a' + n % 26));
            n /= 26;
        }
        return sb.reverse().toString();
    }

    /** The first name in the order that is not {@code taken}. */
    public static String first(Predicate<String> taken) {
        for (int i = 0; ; i++) {
            String candidate = name(i);
            if (!taken.test(candidate)) return candidate;
        }
    }
}
