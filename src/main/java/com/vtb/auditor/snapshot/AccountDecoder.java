package com.vtb.auditor.snapshot;

import com.vtb.auditor.chain.AccountInfo;

import java.math.BigInteger;
import java.util.Map;

/**
 * Разбор данных аккаунта в балансы и поля для правил детекции
 */
public interface AccountDecoder {

    String name();

    boolean supports(AccountInfo account);

    DecodedAccount decode(AccountInfo account);

    record DecodedAccount(Map<String, BigInteger> balances, Map<String, String> fields) {
    }
}
