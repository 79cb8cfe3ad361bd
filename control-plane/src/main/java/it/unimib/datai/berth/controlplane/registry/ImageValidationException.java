package it.unimib.datai.berth.controlplane.registry;

public final class ImageValidationException extends RuntimeException {
    private final String errorCode;

    private ImageValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static ImageValidationException notFound(String image) {
        return new ImageValidationException(
                "IMAGE_NOT_FOUND",
                "Image not found in registry: " + image
        );
    }

    public static ImageValidationException registryUnavailable(String image, String details) {
        String suffix = (details == null || details.isBlank()) ? "" : " (" + details + ")";
        return new ImageValidationException(
                "IMAGE_REGISTRY_UNAVAILABLE",
                "Unable to validate image in registry: " + image + suffix
        );
    }

    public String errorCode() {
        return errorCode;
    }
}
