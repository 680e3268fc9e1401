package com.example.cnab.config;

import com.example.cnab.model.TransactionType;
import com.example.cnab.repository.TransactionTypeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionTypeCatalogInitializerTest {

    @Mock
    private TransactionTypeRepository transactionTypeRepository;

    @InjectMocks
    private TransactionTypeCatalogInitializer initializer;

    @Test
    void seedMissingTypes_createsOnlyAbsentTypes() {
        when(transactionTypeRepository.existsById(anyInt())).thenAnswer(inv -> (Integer) inv.getArgument(0) <= 7);

        int created = initializer.seedMissingTypes();

        assertThat(created).isEqualTo(2);
        ArgumentCaptor<TransactionType> saved = ArgumentCaptor.forClass(TransactionType.class);
        verify(transactionTypeRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(TransactionType::getTypeCode).containsExactly(8, 9);
        assertThat(saved.getAllValues()).extracting(TransactionType::getSign).containsExactly("+", "-");
    }

    @Test
    void seedMissingTypes_isNoOpWhenCatalogIsComplete() {
        when(transactionTypeRepository.existsById(anyInt())).thenReturn(true);

        assertThat(initializer.seedMissingTypes()).isZero();
        verify(transactionTypeRepository, never()).save(any());
    }

    @Test
    void catalog_hasNineTypesWithExpenseSignsNegative() {
        assertThat(TransactionTypeCatalogInitializer.CATALOG).hasSize(9);
        assertThat(TransactionTypeCatalogInitializer.CATALOG)
                .filteredOn(type -> "Expense".equals(type.getNature()))
                .extracting(TransactionType::getTypeCode)
                .containsExactly(1, 2, 3, 9);
    }
}
