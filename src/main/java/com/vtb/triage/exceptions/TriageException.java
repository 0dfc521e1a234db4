package com.vtb.triage.exceptions;

/**
 * Базовая ошибка движка триажа. Движок ее не перехватывает: обработка на вызывающей стороне.
 */
public class TriageException extends RuntimeException {

    public TriageException(String message) {
        super(message);
    }
}
