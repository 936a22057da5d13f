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
import xyz.benanderson.offlinepay.ledger.OfflineBalances;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The single row identifying this device and holding its offline totals.
 */
@Getter
@Setter
@Entity
@Table(name = "device_ledger")
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeviceLedgerEntity {

    @Id
    @Column(name = "device_id", nullable = false, updatable = false)
    private String deviceId;

    @Column(name = "offline_sent", nullable = false, precision = 38, scale = 6)
    private BigDecimal sent;

    @Column(name = "offline_received", nullable = false, precision = 38, scale = 6)
    private BigDecimal received;

    public OfflineBalances asOfflineBalances() {
        return new OfflineBalances(sent, received);
    }

    public void setOfflineBalances(OfflineBalances balances) {
        this.sent = balances.sent();
        this.received = balances.received();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) return false;
        DeviceLedgerEntity that = (DeviceLedgerEntity) o;
        return deviceId != null && Objects.equals(deviceId, that.deviceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceId);
    }

}
