package com.example.routines.docgen.layout;

import lombok.Value;

@Value
public class SpacerElement implements LayoutElement {
    float height;
}
