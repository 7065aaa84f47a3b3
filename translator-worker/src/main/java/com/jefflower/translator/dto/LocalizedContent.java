package com.jefflower.translator.dto;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
public class LocalizedContent {
    String title;
    String description;

    public boolean hasTitle() {
        return title != null && !title.isEmpty();
    }

    public boolean hasDescription() {
        return description != null && !description.isEmpty();
    }
}
