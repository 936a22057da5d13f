package xyz.benanderson.offlinepay.hibernate.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.Hibernate;
import xyz.benanderson.offlinepay.ledger.OfflineAllowance;

import java.math.BigDecimal;
import java.util.Objects;

@Getter
@Setter
@Entity
@Table(name = "offline_allowance")
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OfflineAllowanceEntity {

    /** Lower-cased wallet address. */
    @Id
    @Column(name = "wallet_key", nullable = false, updatable = false)
    private String walletKey;

    @Column(name = "wallet_address", nullable = false)
    private String walletAddress;

    @Column(name = "allowance_limit", nullable = false, precision = 38, scale = 6)
    private BigDecimal limit;

    @Column(name = "spent", nullable = false, precision = 38, scale = 6)
    private BigDecimal spent;

    public OfflineAllowanceEntity(OfflineAllowance allowance) {
        this(OfflineAllowance.key(allowance.walletAddress()), allowance.walletAddress(), allowance.limit(),
                allowance.spent());
    }

    public OfflineAllowance asOfflineAllowance() {
        return new OfflineAllowance(walletAddress, limit, spent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
        OfflineAllowanceEntity that = (OfflineAllowanceEntity) o;
        return walletKey != null && Objects.equals(walletKey, that.walletKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(walletKey);
    }

}
