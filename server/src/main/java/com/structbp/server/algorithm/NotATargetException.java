package com.structbp.server.algorithm;

import com.structbp.server.model.Element;

public class NotATargetException extends IllegalArgumentException {

    public NotATargetException(Element<?> element) {
        super("Element " + element.getName() + " is not a query target of this algorithm");
    }
}
