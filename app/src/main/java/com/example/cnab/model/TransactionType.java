package com.example.cnab.model;

import com.example.cnab.exception.InvalidTransactionSignException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "transaction_types")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TransactionType {

    @Id
    @Column(name = "type_code")
    private Integer typeCode;

    @Column(name = "description", nullable = false, length = 50)
    private String description;

    @Column(name = "nature", nullable = false, length = 20)
    private String nature;

    @Column(name = "sign", nullable = false, length = 1)
    private String sign;

    /**
     * @return +1 para entradas e -1 para saídas.
     */
    public int signMultiplier() {
        if ("+".equals(sign)) {
            return 1;
        }
        if ("-".equals(sign)) {
            return -1;
        }
        throw new InvalidTransactionSignException(typeCode, sign);
    }
}
