package eqace;

/**
 * An exception that points to an offset in the input text.
 */
public class LocatedEquationException extends EquationException {

	/**
	 * 0-based offset into the original input
	 */
	public final int index;

	/**
	 * Short slice of the input starting at {@link #index}
	 */
	public final String nearText;

	public LocatedEquationException(int index, String nearText, String message) {
		super(message);
		this.index = index;
		this.nearText = nearText == null ? "" : nearText;
	}
}
