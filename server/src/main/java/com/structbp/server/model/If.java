package com.structbp.server.model;

public class If<T> extends Chain<Boolean, T> {

    public If(Universe universe, Element<Boolean> test, Element<T> thenClause, Element<T> elseClause) {
        this(universe, null, test, thenClause, elseClause);
    }

    public If(Universe universe, String name, Element<Boolean> test, Element<T> thenClause, Element<T> elseClause) {
        super(universe, name, test, b -> b ? thenClause : elseClause);
    }
}
