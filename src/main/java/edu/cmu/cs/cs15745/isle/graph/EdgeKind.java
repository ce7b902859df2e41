package edu.cmu.cs.cs15745.isle.graph;

public enum EdgeKind {
	EMPTY, POINTS_TO, INDUCTIVE, SEGMENT
}
