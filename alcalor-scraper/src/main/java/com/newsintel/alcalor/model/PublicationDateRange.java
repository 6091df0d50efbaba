package com.newsintel.alcalor.model;

import java.time.LocalDate;

public record PublicationDateRange(LocalDate earliest, LocalDate latest) {
}
