package com.flakedetector.orchestrator.process;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into an argument list using POSIX shell quoting rules,
 * without ever invoking a shell.
 *
 * Supported: whitespace separation, 'single quotes' (fully literal),
 * "double quotes" (backslash escapes only \" \\ \$ \` and newline), and
 * backslash escapes outside quotes. Variables, globs, pipes and redirections
 * are NOT interpreted; "a|b" is one argument.
 */
public final class CommandTokenizer {

    private CommandTokenizer() {}

    /**
     * @throws IllegalArgumentException on an unterminated quote or trailing backslash
     */
    public static List<String> tokenize(String commandLine) {
        if (commandLine == null) {
            throw new IllegalArgumentException("command line must not be null");
        }
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        int i = 0;
        int n = commandLine.length();

        while (i < n) {
            char c = commandLine.charAt(i);
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
                i++;
            } else if (c == '\'') {
                int close = commandLine.indexOf('\'', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated single quote at position " + i);
                }
                current.append(commandLine, i + 1, close);
                inToken = true;
                i = close + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(commandLine, i, current);
                inToken = true;
            } else if (c == '\\') {
                if (i + 1 >= n) {
                    throw new IllegalArgumentException("Trailing backslash at position " + i);
                }
                char next = commandLine.charAt(i + 1);
                if (next != '\n') {   // backslash-newline is a line continuation
                    current.append(next);
                    inToken = true;
                }
                i += 2;
            } else {
                current.append(c);
                inToken = true;
                i++;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return List.copyOf(tokens);
    }

    /** Consumes "..." starting at the opening quote; returns the index after the closing quote. */
    private static int readDoubleQuoted(String s, int open, StringBuilder out) {
        int i = open + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(i + 1);
                switch (next) {
                    case '"', '\\', '$', '`' -> { out.append(next); i += 2; continue; }
                    case '\n' -> { i += 2; continue; }
                    default -> { }
                }
            }
            out.append(c);
            i++;
        }
        throw new IllegalArgumentException("Unterminated double quote at position " + open);
    }
}
