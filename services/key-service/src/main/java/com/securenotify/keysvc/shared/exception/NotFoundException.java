package com.securenotify.keysvc.shared.exception;

public final class NotFoundException extends KeyServiceException {

    private final String resource;

    public NotFoundException(String resource) {
        super(resource + " not found");
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
