package com.example.campuseats.domain.order.validation;

import org.springframework.stereotype.Service;

import com.example.campuseats.domain.menu.service.MenuGateway;
import com.example.campuseats.domain.order.OrderProperties;
import com.example.campuseats.domain.order.RequiredField;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses between the local predicates and the catalog service's validators.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldValidationService {

    private final FieldValidator fieldValidator;
    private final MenuGateway menuGateway;
    private final OrderProperties orderProperties;

    public ValidationResult validate(RequiredField field, String message) {
        if (orderProperties.remoteValidation() && field.isRemotelyValidatable()) {
            log.debug("Validating {} through the catalog service", field);
            return menuGateway.validateViaTool(field, message);
        }
        return fieldValidator.validate(field, message);
    }

    public boolean isPlausible(RequiredField field, String message) {
        return fieldValidator.isPlausible(field, message);
    }
}
