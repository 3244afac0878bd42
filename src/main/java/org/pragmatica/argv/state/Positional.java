package org.pragmatica.argv.state;

/**
 * A bare argument, tagged with how it was classified when consumed.
 */
public sealed interface Positional {

    String value();

    record Required(String value) implements Positional {}

    record Optional(String value) implements Positional {}

    record Rest(String value) implements Positional {}
}
