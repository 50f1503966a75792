package com.vectororm.orm.fixture;

import com.vectororm.orm.connection.ConnectionRegistry;

/**
 * Registry the fixture models are bound to, kept apart from the global one.
 */
public final class Fixtures {

    public static final String ALIAS = "fixtures";
    public static final ConnectionRegistry REGISTRY = new ConnectionRegistry();

    private Fixtures() {
    }
}
