package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

public class ModelLoadFailureException extends SmartBetException {

    private final String leagueKey;

    public ModelLoadFailureException(String leagueKey, String message) {
        super(ErrorCode.MODEL_LOAD_FAILURE, message);
        this.leagueKey = leagueKey;
    }

    public ModelLoadFailureException(String leagueKey, String message, Throwable e) {
        super(ErrorCode.MODEL_LOAD_FAILURE, message, e);
        this.leagueKey = leagueKey;
    }

    public String getLeagueKey() {
        return leagueKey;
    }
}
