package at.sv.lights.device;

public interface DeviceStreamListener {
    void onLine(String line);

    void onError(Throwable error);

    void onClosed();
}
