package com.dcruver.itemstore.store;

import com.dcruver.itemstore.domain.ConflictException;
import com.dcruver.itemstore.domain.ItemStoreException;
import com.dcruver.itemstore.domain.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Transaction boundary for every logical store operation.
 *
 * Work runs in one all-or-nothing transaction; a call made while a transaction
 * is already open joins it. Database failures leave as {@link ConflictException}
 * (uniqueness violated) or {@link StorageFailureException}.
 */
@Component
@Slf4j
public class StoreTransactions {

    private final TransactionTemplate transactionTemplate;

    public StoreTransactions(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (ItemStoreException e) {
            log.debug("{} rolled back: {}", operation, e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed and was rolled back", operation, e);
            throw translate(operation, e);
        }
    }

    public void run(String operation, Runnable work) {
        inTransaction(operation, () -> {
            work.run();
            return null;
        });
    }

    private ItemStoreException translate(String operation, RuntimeException e) {
        if (e instanceof DuplicateKeyException || isUniquenessViolation(e)) {
            return new ConflictException(operation + " violates a uniqueness constraint", e);
        }
        return new StorageFailureException(operation + " failed: " + e.getMessage(), e);
    }

    private boolean isUniquenessViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLiteException sqliteException) {
                SQLiteErrorCode code = sqliteException.getResultCode();
                if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                    || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                    return true;
                }
                String message = sqliteException.getMessage();
                return message != null && message.contains("UNIQUE constraint failed");
            }
        }
        return false;
    }
}
