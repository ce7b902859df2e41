package edu.cmu.cs.cs15745.isle.graph;

/** Kind of value a node stands for. */
public enum NodeType {
	/** An address. */
	ADDR,
	/** An integer value. */
	INT,
	/** Raw contents, no known structure. */
	RAW
}
