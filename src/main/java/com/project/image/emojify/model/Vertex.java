package com.project.image.emojify.model;

public record Vertex(int x, int y) {}
