package io.github.cyfko.sheetlogic.core.model;

import io.github.cyfko.sheetlogic.core.exception.WorkbookDefinitionException;
import io.github.cyfko.sheetlogic.core.value.EvaluatedValue;

import java.util.Objects;

/**
 * A cell as handed over by the upstream classifier.
 *
 * <pre>{@code
 * ClassifiedCell price = ClassifiedCell.input(Coordinate.of("Sheet1", "B2"), 120.0)
 *         .withValidation(Validation.number(0.0, 1000.0));
 * ClassifiedCell total = ClassifiedCell.formula(Coordinate.of("Sheet1", "B4"), CellRole.OUTPUT, "=B2*(1+B3)");
 * }</pre>
 *
 * @param coordinate   location of the cell
 * @param role         classification
 * @param rawFormula   formula text starting with {@code '='}, or null for constant cells
 * @param currentValue value found in the workbook snapshot, never null
 * @param validation   data-validation metadata, or null
 * @param label        nearby caption found by the classifier, or null
 * @param iterative    iterative-calculation settings for this cell, or null when not enabled
 * @since 1.0.0
 */
public record ClassifiedCell(
        Coordinate coordinate,
        CellRole role,
        String rawFormula,
        EvaluatedValue currentValue,
        Validation validation,
        String label,
        IterativeSettings iterative
) {

    public ClassifiedCell {
        if (coordinate == null)
            throw new WorkbookDefinitionException("coordinate cannot be null");
        if (role == null)
            throw new WorkbookDefinitionException("role cannot be null for cell " + coordinate);
        if (rawFormula != null && rawFormula.isBlank())
            rawFormula = null;
        if (rawFormula != null && !rawFormula.startsWith("="))
            throw new WorkbookDefinitionException("formula of " + coordinate + " must start with '=': " + rawFormula);
        currentValue = currentValue == null ? EvaluatedValue.empty() : currentValue;
    }

    public static ClassifiedCell input(Coordinate coordinate, Object value) {
        return new ClassifiedCell(coordinate, CellRole.INPUT, null, EvaluatedValue.of(value), null, null, null);
    }

    public static ClassifiedCell formula(Coordinate coordinate, CellRole role, String formula) {
        return new ClassifiedCell(coordinate, role, formula, EvaluatedValue.empty(), null, null, null);
    }

    public static ClassifiedCell label(Coordinate coordinate, String text) {
        return new ClassifiedCell(coordinate, CellRole.LABEL, null, EvaluatedValue.text(text), null, null, null);
    }

    public boolean hasFormula() {
        return rawFormula != null;
    }

    public ClassifiedCell withValidation(Validation validation) {
        return new ClassifiedCell(coordinate, role, rawFormula, currentValue, validation, label, iterative);
    }

    public ClassifiedCell withLabel(String label) {
        return new ClassifiedCell(coordinate, role, rawFormula, currentValue, validation, label, iterative);
    }

    public ClassifiedCell withCurrentValue(Object value) {
        return new ClassifiedCell(coordinate, role, rawFormula, EvaluatedValue.of(value), validation, label, iterative);
    }

    public ClassifiedCell withIterative(IterativeSettings settings) {
        return new ClassifiedCell(coordinate, role, rawFormula, currentValue, validation, label,
                Objects.requireNonNull(settings, "settings"));
    }
}
