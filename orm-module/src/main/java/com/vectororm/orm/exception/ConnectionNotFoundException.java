package com.vectororm.orm.exception;

public class ConnectionNotFoundException extends VectorOrmException {

    private final String alias;

    public ConnectionNotFoundException(String alias) {
        super("No connection registered under alias '" + alias + "'");
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }
}
