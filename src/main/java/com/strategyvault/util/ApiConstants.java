package com.strategyvault.util;

public final class ApiConstants {

    private ApiConstants() {
        throw new AssertionError("Cannot instantiate constants class");
    }

    public static final String USER_HEADER = "X-User-Id";

    // API Messages
    public static final String MSG_DEPOSIT_SUCCESS = "Deposit accepted";
    public static final String MSG_MINT_SUCCESS = "Shares minted";
    public static final String MSG_WITHDRAW_SETTLED = "Withdrawal settled";
    public static final String MSG_WITHDRAW_QUEUED = "Withdrawal queued until liquidity is available";
    public static final String MSG_WITHDRAWAL_COMPLETED = "Queued withdrawal completed";
    public static final String MSG_STRATEGY_ADDED = "Strategy added";
    public static final String MSG_ALLOCATION_UPDATED = "Strategy allocation updated";
    public static final String MSG_STRATEGY_REMOVED = "Strategy deactivated";
    public static final String MSG_REBALANCE_COMPLETED = "Rebalance completed";
    public static final String MSG_STRATEGY_UNWOUND = "Strategy unwound to idle balance";
    public static final String MSG_SHARES_APPROVED = "Share allowance updated";
    public static final String MSG_VAULT_PAUSED = "Vault paused";
    public static final String MSG_VAULT_UNPAUSED = "Vault unpaused";
    public static final String MSG_EMERGENCY_UNWIND = "Emergency unwind completed";

    // Log Messages
    public static final String LOG_DEPOSIT_REQUEST = "API Request - Deposit {} by {} for receiver {}";
    public static final String LOG_MINT_REQUEST = "API Request - Mint {} shares by {} for receiver {}";
    public static final String LOG_WITHDRAW_REQUEST = "API Request - Withdraw {} by {} (owner={}, receiver={})";
    public static final String LOG_REDEEM_REQUEST = "API Request - Redeem {} shares by {} (owner={}, receiver={})";
    public static final String LOG_WITHDRAW_RESPONSE = "API Response - Withdrawal {} for owner {}: {} assets, {} shares";
    public static final String LOG_COMPLETE_REQUEST = "API Request - Complete withdrawal #{} for {}";
    public static final String LOG_ADD_STRATEGY_REQUEST = "API Request - Add {} strategy {} at {} bps by {}";
    public static final String LOG_UPDATE_ALLOCATION_REQUEST = "API Request - Update strategy #{} to {} bps by {}";
    public static final String LOG_REMOVE_STRATEGY_REQUEST = "API Request - Remove strategy #{} by {}";
    public static final String LOG_REBALANCE_REQUEST = "API Request - Rebalance by {}";
    public static final String LOG_GET_METRICS_REQUEST = "API Request - Get vault metrics";
    public static final String LOG_REBALANCE_RESPONSE = "API Response - Rebalance divested {} and invested {}, idle now {}";
    public static final String LOG_UNWIND_REQUEST = "API Request - Unwind strategy #{} by {}";
    public static final String LOG_PAUSE_REQUEST = "API Request - Pause vault by {}";
    public static final String LOG_UNPAUSE_REQUEST = "API Request - Unpause vault by {}";
    public static final String LOG_EMERGENCY_REQUEST = "API Request - Emergency withdraw all by {}";
}
