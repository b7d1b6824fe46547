package com.github.musiKk.quench.document;

import com.github.musiKk.quench.QuenchException;

public class AlreadyOpenException extends QuenchException {

    private static final long serialVersionUID = 1L;

    public AlreadyOpenException(String id) {
        super("document already open: " + id);
    }
}
