package io.chainrun.core.chain;

import java.io.Serial;

public class ChainNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = -2871904426655128731L;

    public ChainNotFoundException(String message) {
        super(message);
    }
}
