package xyz.benanderson.offlinepay.hibernate;

import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;

public abstract class DatabaseAccessor implements AutoCloseable {

    private final SessionFactory databaseSessionFactory;

    public DatabaseAccessor(SessionFactory databaseSessionFactory) {
        this.databaseSessionFactory = databaseSessionFactory;
    }

    @Override
    public void close() {
        databaseSessionFactory.close();
    }

    @FunctionalInterface
    protected interface SessionWork<T> {
        T apply(Session session) throws OfflinePayException;
    }

    /**
     * Runs read-only work in a fresh session.
     *
     * @throws StorageException wrapping any Hibernate or persistence failure
     */
    protected <T> T read(SessionWork<T> work) throws StorageException {
        try (Session session = databaseSessionFactory.openSession()) {
            return work.apply(session);
        } catch (StorageException e) {
            throw e;
        } catch (OfflinePayException | RuntimeException e) {
            OfflinePay.LOGGER.error("Hibernate error occurred.", e);
            throw new StorageException("Could not read from the database", e);
        }
    }

    /**
     * Runs work in one database transaction, committed only if the work returns normally. Exceptions thrown by the
     * work are rethrown after rollback; Hibernate and persistence failures become {@link StorageException}s.
     */
    protected <T> T inTransaction(SessionWork<T> work) throws OfflinePayException {
        Session session;
        try {
            session = databaseSessionFactory.openSession();
        } catch (RuntimeException e) {
            throw new StorageException("Could not open a database session", e);
        }
        try (session) {
            Transaction transaction = session.beginTransaction();
            try {
                T result = work.apply(session);
                transaction.commit();
                return result;
            } catch (OfflinePayException | RuntimeException e) {
                rollback(transaction);
                if (e instanceof OfflinePayException) throw (OfflinePayException) e;
                OfflinePay.LOGGER.error("Hibernate error occurred, transaction rolled back.", e);
                throw new StorageException("Could not write to the database", e);
            }
        } catch (RuntimeException e) {
            throw new StorageException("Could not use the database session", e);
        }
    }

    private void rollback(Transaction transaction) {
        try {
            if (transaction.isActive()) transaction.rollback();
        } catch (RuntimeException e) {
            OfflinePay.LOGGER.error("Hibernate error occurred when rolling back.", e);
        }
    }

}
