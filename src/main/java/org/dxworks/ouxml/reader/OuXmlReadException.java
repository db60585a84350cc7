package org.dxworks.ouxml.reader;

public class OuXmlReadException extends RuntimeException {

    public OuXmlReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
