package xyz.benanderson.offlinepay.hibernate.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.Hibernate;
import xyz.benanderson.offlinepay.exception.MalformedVoucherException;
import xyz.benanderson.offlinepay.ledger.PendingTransaction;
import xyz.benanderson.offlinepay.ledger.TransactionStatus;
import xyz.benanderson.offlinepay.ledger.TransactionType;
import xyz.benanderson.offlinepay.voucher.VoucherCodec;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

@Getter
@Setter
@Entity
@Table(name = "pending_transaction", indexes = @Index(name = "idx_ephemeral_address", columnList = "ephemeral_address"))
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PendingTransactionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "insertion_order", nullable = false, updatable = false)
    private long insertionOrder;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false)
    private TransactionType type;

    @Column(name = "from_address", nullable = false, updatable = false)
    private String fromAddress;

    @Column(name = "to_address", nullable = false, updatable = false)
    private String toAddress;

    @Column(name = "amount", nullable = false, updatable = false, precision = 38, scale = 6)
    private BigDecimal amount;

    /** Encoded voucher, including its ephemeral key. */
    @Column(name = "voucher_data", nullable = false, updatable = false, length = 4096)
    private String voucherData;

    /** Lower-cased address of the voucher's one-time key, used for redemption checks. */
    @Column(name = "ephemeral_address", nullable = false, updatable = false, length = 42)
    private String ephemeralAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TransactionStatus status;

    @Column(name = "device_id", nullable = false, updatable = false)
    private String deviceId;

    @Column(name = "tx_hash")
    private String txHash;

    public PendingTransactionEntity(PendingTransaction transaction, long insertionOrder) {
        this(transaction.id(), insertionOrder, transaction.type(), transaction.from(), transaction.to(),
                transaction.amount(), VoucherCodec.encodeVoucher(transaction.voucher()),
                transaction.ephemeralAddress(), transaction.timestamp().toEpochMilli(),
                transaction.status(), transaction.deviceId(), transaction.txHash());
    }

    /**
     * @throws IllegalStateException if the stored voucher can no longer be decoded
     */
    public PendingTransaction asPendingTransaction() {
        try {
            return new PendingTransaction(id, type, fromAddress, toAddress, amount,
                    VoucherCodec.decodeVoucher(voucherData), ephemeralAddress, Instant.ofEpochMilli(createdAt), status,
                    deviceId, txHash);
        } catch (MalformedVoucherException e) {
            throw new IllegalStateException("Stored voucher of transaction " + id + " is corrupt", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
        PendingTransactionEntity that = (PendingTransactionEntity) o;
        return id != null && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

}
