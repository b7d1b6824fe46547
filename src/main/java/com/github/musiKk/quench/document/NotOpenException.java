package com.github.musiKk.quench.document;

import com.github.musiKk.quench.QuenchException;

public class NotOpenException extends QuenchException {

    private static final long serialVersionUID = 1L;

    public NotOpenException(String id) {
        super("document not open: " + id);
    }
}
