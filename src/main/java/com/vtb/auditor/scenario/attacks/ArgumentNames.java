package com.vtb.auditor.scenario.attacks;

/**
 * Имена аргументов, которые сценарии передают в шаблоны инструкций.
 * Шаблон берет только те, что объявлены в его args.
 */
final class ArgumentNames {

    static final String AMOUNT = "amount";
    static final String NEW_AUTHORITY = "new_authority";
    static final String PRICE = "price";
    static final String TIMESTAMP = "timestamp";
    static final String MINIMUM_AMOUNT_OUT = "minimum_amount_out";

    private ArgumentNames() {
    }
}
