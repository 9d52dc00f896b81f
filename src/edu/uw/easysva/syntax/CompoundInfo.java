package edu.uw.easysva.syntax;

import java.util.Arrays;
import java.util.List;

import edu.uw.easysva.lexicon.GrammaticalNumber;

/**
 * Two subjects joined by "and", "or" or "nor", and the number the pair imposes on the verb. Indexes refer to the
 * word list the compound was found in.
 */
public class CompoundInfo {
	private final Coordinator coordinator;
	private final Token firstSubject;
	private final Token secondSubject;
	private final int firstIndex;
	private final int coordinatorIndex;
	private final int secondIndex;
	private final GrammaticalNumber resultNumber;

	CompoundInfo(final Coordinator coordinator, final Token firstSubject, final int firstIndex,
			final int coordinatorIndex, final Token secondSubject, final int secondIndex,
			final GrammaticalNumber resultNumber) {
		this.coordinator = coordinator;
		this.firstSubject = firstSubject;
		this.firstIndex = firstIndex;
		this.coordinatorIndex = coordinatorIndex;
		this.secondSubject = secondSubject;
		this.secondIndex = secondIndex;
		this.resultNumber = resultNumber;
	}

	public Coordinator getCoordinator() {
		return coordinator;
	}

	public List<String> getSubjects() {
		return Arrays.asList(firstSubject.getText(), secondSubject.getText());
	}

	public Token getFirstSubject() {
		return firstSubject;
	}

	public Token getSecondSubject() {
		return secondSubject;
	}

	public int getFirstIndex() {
		return firstIndex;
	}

	public int getCoordinatorIndex() {
		return coordinatorIndex;
	}

	public int getSecondIndex() {
		return secondIndex;
	}

	public GrammaticalNumber getResultNumber() {
		return resultNumber;
	}

	/**
	 * e.g. "Mark and Anna"
	 */
	public String getDisplayText() {
		return firstSubject.getText() + " " + coordinator + " " + secondSubject.getText();
	}

	@Override
	public String toString() {
		return getDisplayText() + " (" + resultNumber + ")";
	}
}
