package com.github.salilvnair.formflow.repo;

import com.github.salilvnair.formflow.entity.FfAutofillHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AutofillHistoryRepository
        extends JpaRepository<FfAutofillHistory, Long> {

    List<FfAutofillHistory> findByUserIdAndFieldNameAndFieldType(String userId, String fieldName, String fieldType);

    Optional<FfAutofillHistory> findFirstByUserIdAndFieldNameAndFieldTypeAndValue(
            String userId, String fieldName, String fieldType, String value);
}
