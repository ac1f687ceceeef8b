package com.infomedia.abacox.feeschedule.constants;

public final class DateTimePattern {
    public static final String DATE = "yyyy-MM-dd";
    public static final String DATE_TIME = "yyyy-MM-dd'T'HH:mm:ss";

    private DateTimePattern() {
    }
}
