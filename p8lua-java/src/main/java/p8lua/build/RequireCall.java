package p8lua.build;

import p8lua.lexer.Token;

/**
 * One {@code require("path"[, {use_game_loop=...}])} found in a program.
 *
 * @param path        the string literal's contents
 * @param useGameLoop whether the module keeps its lifecycle callbacks
 * @param token       the {@code require} name, for error positions
 */
public record RequireCall(String path, boolean useGameLoop, Token token) {}
