package com.taxengine.formula;

import com.taxengine.contract.ErrorType;
import com.taxengine.contract.RuleEngineException;

public class FormulaParseException extends RuleEngineException {

    private final int position;

    public FormulaParseException(String expression, int position, String message) {
        super(ErrorType.FORMULA_PARSE_ERROR, "parse",
            message + " at position " + position + " in '" + expression + "'");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
