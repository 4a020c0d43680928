package com.proseparser.ast;

final class Names {

    private Names() {
    }

    static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
    }
}
