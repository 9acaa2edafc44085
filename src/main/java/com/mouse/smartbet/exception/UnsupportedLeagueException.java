package com.mouse.smartbet.exception;

import com.mouse.smartbet.enums.ErrorCode;

public class UnsupportedLeagueException extends SmartBetException {

    private final String leagueName;

    public UnsupportedLeagueException(String leagueName, String message) {
        super(ErrorCode.UNSUPPORTED_LEAGUE, message);
        this.leagueName = leagueName;
    }

    public String getLeagueName() {
        return leagueName;
    }
}
