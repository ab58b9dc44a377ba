package com.precojusto.cronbatch.jobs.aireport;

public enum ReportType {
    PRICE_VARIATION,
    CUSTOM_TRIGGER
}
