package com.webapp.authservice.Validators;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;

import java.util.Objects;

public class PasswordMatchValidator implements ConstraintValidator<PasswordMatch, Object> {

    private String passwordField;
    private String passwordConfirmationField;

    @Override
    public void initialize(PasswordMatch constraint) {
        this.passwordField = constraint.passwordField();
        this.passwordConfirmationField = constraint.passwordConfirmationField();
    }

    @Override
    public boolean isValid(Object value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(value);
        Object password = wrapper.getPropertyValue(passwordField);
        Object confirmation = wrapper.getPropertyValue(passwordConfirmationField);

        // Missing values are left to @NotBlank on the fields themselves.
        if (password == null || confirmation == null) {
            return true;
        }
        if (Objects.equals(password, confirmation)) {
            return true;
        }
        context.disableDefaultConstraintViolation();
        context.buildConstraintViolationWithTemplate(context.getDefaultConstraintMessageTemplate())
                .addPropertyNode(passwordConfirmationField)
                .addConstraintViolation();
        return false;
    }
}
