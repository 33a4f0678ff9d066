package com.bitcred.auth;

import com.bitcred.exception.ErrorCode;
import com.bitcred.exception.UnauthorizedException;
import com.bitcred.ledger.JournaledMap;
import com.bitcred.ledger.LedgerTransactionManager;
import java.util.Objects;

/**
 * Admin account plus the set of approved scorers, owned by one ledger component.
 *
 * <p>The admin is implicitly an approved scorer from construction on. Approval flags live in
 * journaled storage so an approval made inside a failed operation is undone with it.
 */
public class AccessControl {

    private final String admin;
    private final JournaledMap<String, Boolean> approvedScorers;

    public AccessControl(String admin, LedgerTransactionManager transactionManager) {
        this.admin = Objects.requireNonNull(admin, "admin");
        this.approvedScorers = new JournaledMap<>(transactionManager);
    }

    /**
     * Marks the admin as an approved scorer. Must run inside a ledger operation.
     */
    public void bootstrap() {
        approvedScorers.put(admin, Boolean.TRUE);
    }

    public String getAdmin() {
        return admin;
    }

    public boolean isAdmin(String account) {
        return admin.equals(account);
    }

    public boolean isApprovedScorer(String account) {
        return account != null && approvedScorers.getOrDefault(account, Boolean.FALSE);
    }

    public void requireAdmin(String caller) {
        if (!isAdmin(caller)) {
            throw new UnauthorizedException(ErrorCode.ADMIN_ONLY, "Only the admin may perform this operation");
        }
    }

    public void approve(String account) {
        approvedScorers.put(account, Boolean.TRUE);
    }

    public void revoke(String account) {
        approvedScorers.put(account, Boolean.FALSE);
    }
}
