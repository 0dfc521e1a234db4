package com.vtb.triage.exceptions;

/**
 * Профиль классификации собран некорректно (неизвестная группа, пустой набор групп и т.п.)
 */
public class InvalidProfileException extends TriageException {

    public InvalidProfileException(String profileName, String reason) {
        super("Некорректный профиль '" + profileName + "': " + reason);
    }
}
