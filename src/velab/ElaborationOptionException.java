package velab;

public class ElaborationOptionException extends Exception {

	private static final long serialVersionUID = -4427934207730616245L;

	public ElaborationOptionException(String message) {
		super(message);
	}

}
