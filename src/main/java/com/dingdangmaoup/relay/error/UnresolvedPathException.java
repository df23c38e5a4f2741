package com.dingdangmaoup.relay.error;

public class UnresolvedPathException extends RelayException {

    private final String path;

    public UnresolvedPathException(String path) {
        super(ErrorKind.UNRESOLVED_PATH, "No upstream registry for path: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
