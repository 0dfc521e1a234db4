package com.vtb.triage.exceptions;

public class EmptyInputException extends TriageException {

    public EmptyInputException() {
        super("Входная таблица не содержит ни одной записи");
    }
}
